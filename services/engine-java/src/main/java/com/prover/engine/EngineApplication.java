package com.prover.engine;

import com.prover.engine.grpc.EmbeddedGrpcServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.IOException;
import java.util.Map;

@SpringBootApplication
public class EngineApplication {

    private static final Logger log = LoggerFactory.getLogger(EngineApplication.class);

    static final int DEFAULT_GRPC_PORT = 9192;

    public static void main(String[] args) throws IOException {
        ConfigurableApplicationContext context = SpringApplication.run(EngineApplication.class, args);
        int configured = context.getEnvironment().getProperty("engine.grpc.port", Integer.class, DEFAULT_GRPC_PORT);
        int grpcPort = resolveGrpcPort(System.getenv(), configured);
        context.getBean(EmbeddedGrpcServer.class).start(grpcPort);
        log.info("Proof engine started");
    }

    /**
     * Picks the gRPC port: {@code PROVER_GRPC_PORT}, then the port part of {@code PROVER_ENGINE_ADDR}
     * ("host:port" or "port"), then {@code configured}. Unparseable values are skipped.
     */
    static int resolveGrpcPort(Map<String, String> env, int configured) {
        Integer explicit = parsePort(env.get("PROVER_GRPC_PORT"));
        if (explicit != null) {
            return explicit;
        }
        String addr = env.get("PROVER_ENGINE_ADDR");
        if (addr != null) {
            int colon = addr.lastIndexOf(':');
            Integer fromAddr = parsePort(colon != -1 ? addr.substring(colon + 1) : addr);
            if (fromAddr != null) {
                return fromAddr;
            }
        }
        return configured;
    }

    private static Integer parsePort(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid port '{}'", value);
            return null;
        }
    }
}
