package com.prover.engine.grpc;

import com.prover.engine.CollaboratorException;
import com.prover.engine.EngineException;
import com.prover.engine.VerificationException;
import com.prover.engine.invariant.DiscoveredInvariant;
import com.prover.engine.logic.PropertyFormula;
import com.prover.engine.service.DocumentVerifier;
import com.prover.engine.service.PropertyVerifier;
import com.prover.grpc.ConsistencyReply;
import com.prover.grpc.ConsistencyRequest;
import com.prover.grpc.Document;
import com.prover.grpc.InvariantSpec;
import com.prover.grpc.PropertyRequest;
import com.prover.grpc.ProofReply;
import com.prover.grpc.VerificationReport;
import io.grpc.MethodDescriptor;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.protobuf.ProtoUtils;
import io.grpc.stub.ServerCalls;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Serves the engine over gRPC. Method descriptors are built by hand from the protobuf messages, so no
 * generated stubs are needed.
 */
public class EmbeddedGrpcServer {

    private static final Logger log = LoggerFactory.getLogger(EmbeddedGrpcServer.class);

    public static final String SERVICE_NAME = "prover.engine.ProofEngine";

    public static final MethodDescriptor<Document, VerificationReport> VERIFY_DOCUMENT =
            MethodDescriptor.<Document, VerificationReport>newBuilder()
                    .setType(MethodDescriptor.MethodType.UNARY)
                    .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE_NAME, "VerifyDocument"))
                    .setRequestMarshaller(ProtoUtils.marshaller(Document.getDefaultInstance()))
                    .setResponseMarshaller(ProtoUtils.marshaller(VerificationReport.getDefaultInstance()))
                    .build();

    public static final MethodDescriptor<PropertyRequest, ProofReply> VERIFY_PROPERTY =
            MethodDescriptor.<PropertyRequest, ProofReply>newBuilder()
                    .setType(MethodDescriptor.MethodType.UNARY)
                    .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE_NAME, "VerifyProperty"))
                    .setRequestMarshaller(ProtoUtils.marshaller(PropertyRequest.getDefaultInstance()))
                    .setResponseMarshaller(ProtoUtils.marshaller(ProofReply.getDefaultInstance()))
                    .build();

    public static final MethodDescriptor<ConsistencyRequest, ConsistencyReply> VERIFY_CONSISTENCY =
            MethodDescriptor.<ConsistencyRequest, ConsistencyReply>newBuilder()
                    .setType(MethodDescriptor.MethodType.UNARY)
                    .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE_NAME, "VerifyConsistency"))
                    .setRequestMarshaller(ProtoUtils.marshaller(ConsistencyRequest.getDefaultInstance()))
                    .setResponseMarshaller(ProtoUtils.marshaller(ConsistencyReply.getDefaultInstance()))
                    .build();

    private final PropertyVerifier propertyVerifier;
    private final DocumentVerifier documentVerifier;
    private Server server;

    public EmbeddedGrpcServer(PropertyVerifier propertyVerifier, DocumentVerifier documentVerifier) {
        this.propertyVerifier = propertyVerifier;
        this.documentVerifier = documentVerifier;
    }

    public ServerServiceDefinition bindService() {
        return ServerServiceDefinition.builder(SERVICE_NAME)
                .addMethod(VERIFY_DOCUMENT, ServerCalls.asyncUnaryCall(
                        (Document request, StreamObserver<VerificationReport> responseObserver) ->
                                respond(responseObserver, () -> ProtoMapper.toReport(
                                        documentVerifier.verifyDocument(ProtoMapper.toDocument(request))))))
                .addMethod(VERIFY_PROPERTY, ServerCalls.asyncUnaryCall(
                        (PropertyRequest request, StreamObserver<ProofReply> responseObserver) ->
                                respond(responseObserver, () -> verifyProperty(request))))
                .addMethod(VERIFY_CONSISTENCY, ServerCalls.asyncUnaryCall(
                        (ConsistencyRequest request, StreamObserver<ConsistencyReply> responseObserver) ->
                                respond(responseObserver, () -> verifyConsistency(request))))
                .build();
    }

    private ProofReply verifyProperty(PropertyRequest request) throws EngineException {
        if (!request.hasFormula()) {
            throw new IllegalArgumentException("request has no formula");
        }
        PropertyFormula formula = PropertyFormula.of(ProtoMapper.toFormula(request.getFormula()));
        return ProofReply.newBuilder()
                .setProof(ProtoMapper.toProof(propertyVerifier.verifyProperty(formula)))
                .build();
    }

    private ConsistencyReply verifyConsistency(ConsistencyRequest request) throws EngineException {
        List<DiscoveredInvariant> invariants = new ArrayList<>();
        for (InvariantSpec spec : request.getInvariantsList()) {
            invariants.add(ProtoMapper.toInvariant(spec));
        }
        return ProtoMapper.toReply(documentVerifier.verifyConsistency(invariants));
    }

    private static <T> void respond(StreamObserver<T> responseObserver, EngineCall<T> call) {
        try {
            responseObserver.onNext(call.execute());
            responseObserver.onCompleted();
        } catch (VerificationException e) {
            responseObserver.onError(Status.FAILED_PRECONDITION.withDescription(e.getMessage()).asRuntimeException());
        } catch (CollaboratorException e) {
            log.warn("Collaborator failure: {}", e.getMessage());
            responseObserver.onError(Status.UNAVAILABLE.withDescription(e.getMessage()).asRuntimeException());
        } catch (IllegalArgumentException e) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException());
        } catch (EngineException e) {
            log.error("Engine failure", e);
            responseObserver.onError(Status.INTERNAL.withDescription(e.getMessage()).asRuntimeException());
        } catch (RuntimeException e) {
            log.error("Unexpected engine error", e);
            responseObserver.onError(Status.INTERNAL.withDescription(String.valueOf(e)).withCause(e)
                    .asRuntimeException());
        }
    }

    @FunctionalInterface
    private interface EngineCall<T> {
        T execute() throws EngineException;
    }

    public void start(int port) throws IOException {
        server = ServerBuilder.forPort(port)
                .addService(bindService())
                .build()
                .start();

        log.info("Embedded gRPC server started on port {}", server.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server");
            EmbeddedGrpcServer.this.stop();
        }));
    }

    public int getPort() {
        return server == null ? -1 : server.getPort();
    }

    public void stop() {
        if (server != null) {
            server.shutdown();
        }
    }
}
