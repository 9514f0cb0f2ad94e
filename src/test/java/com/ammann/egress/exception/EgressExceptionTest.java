/* (C)2026 */
package com.ammann.egress.exception;

import static org.assertj.core.api.Assertions.assertThat;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.Test;

class EgressExceptionTest {

    @Test
    void factoriesFixTheKind() {
        assertThat(EgressException.fatal("listener", null).getKind())
                .isEqualTo(EgressException.Kind.FATAL);
        assertThat(EgressException.user("bad url").getKind()).isEqualTo(EgressException.Kind.USER);
        assertThat(EgressException.egressNotFound().getKind())
                .isEqualTo(EgressException.Kind.NOT_FOUND);
        assertThat(EgressException.deadlineExceeded("slow").getKind())
                .isEqualTo(EgressException.Kind.DEADLINE_EXCEEDED);
        assertThat(EgressException.internal("boom", null).getKind())
                .isEqualTo(EgressException.Kind.INTERNAL);
    }

    @Test
    void onlyFatalKindIsFatal() {
        assertThat(EgressException.fatal("listener", new RuntimeException()).isFatal()).isTrue();
        assertThat(EgressException.user("bad url").isFatal()).isFalse();
        assertThat(EgressException.unavailable("down", null).isFatal()).isFalse();
    }

    @Test
    void busFailureCodesFollowHttpSemantics() {
        assertThat(EgressException.Kind.NOT_FOUND.code()).isEqualTo(404);
        assertThat(EgressException.Kind.USER.code()).isEqualTo(400);
        assertThat(EgressException.Kind.DEADLINE_EXCEEDED.code()).isEqualTo(504);
        assertThat(EgressException.Kind.FATAL.code()).isEqualTo(500);
    }

    @Test
    void mapsKindsToGrpcCodes() {
        assertThat(GrpcStatusMapper.toStatusException(EgressException.egressNotFound()).getStatus().getCode())
                .isEqualTo(Status.Code.NOT_FOUND);
        assertThat(
                        GrpcStatusMapper.toStatusException(EgressException.deadlineExceeded("slow"))
                                .getStatus()
                                .getCode())
                .isEqualTo(Status.Code.DEADLINE_EXCEEDED);
        assertThat(GrpcStatusMapper.toStatusException(EgressException.user("bad")).getStatus().getCode())
                .isEqualTo(Status.Code.INVALID_ARGUMENT);
        assertThat(
                        GrpcStatusMapper.toStatusException(EgressException.fatal("x", null))
                                .getStatus()
                                .getCode())
                .isEqualTo(Status.Code.INTERNAL);
    }

    @Test
    void keepsDescriptionOfEgressErrors() {
        StatusRuntimeException mapped =
                GrpcStatusMapper.toStatusException(
                        EgressException.deadlineExceeded("timed out requesting pipeline debug info"));

        assertThat(mapped.getStatus().getDescription())
                .isEqualTo("timed out requesting pipeline debug info");
    }

    @Test
    void passesStatusExceptionsThrough() {
        StatusRuntimeException original = Status.UNAUTHENTICATED.asRuntimeException();

        assertThat(GrpcStatusMapper.toStatusException(original)).isSameAs(original);
    }

    @Test
    void mapsUnknownFailuresToInternal() {
        StatusRuntimeException mapped =
                GrpcStatusMapper.toStatusException(new IllegalStateException("unexpected"));

        assertThat(mapped.getStatus().getCode()).isEqualTo(Status.Code.INTERNAL);
        assertThat(mapped.getStatus().getDescription()).isEqualTo("unexpected");
    }
}
