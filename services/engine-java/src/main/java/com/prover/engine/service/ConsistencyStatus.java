package com.prover.engine.service;

import java.util.List;

public sealed interface ConsistencyStatus {

    record Consistent() implements ConsistencyStatus {
    }

    record Inconsistent(List<String> conflictingConstraints) implements ConsistencyStatus {

        public Inconsistent {
            conflictingConstraints = List.copyOf(conflictingConstraints);
        }
    }

    record Unknown(String reason) implements ConsistencyStatus {
    }
}
