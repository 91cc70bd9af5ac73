package com.blissfly.proxy.core.services;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FatalErrorHandlerTest {

    @Test
    void uncaughtException_exitsWithStatusOne() {
        List<Integer> exits = new ArrayList<>();
        FatalErrorHandler handler = new FatalErrorHandler(false, exits::add);

        handler.uncaughtException(new Thread("worker"), new OutOfMemoryError("boom"));

        assertThat(exits).containsExactly(FatalErrorHandler.EXIT_STATUS);
    }

    @Test
    void uncaughtException_debugKeepsProcessAlive() {
        List<Integer> exits = new ArrayList<>();
        FatalErrorHandler handler = new FatalErrorHandler(true, exits::add);

        handler.uncaughtException(new Thread("worker"), new IllegalStateException("boom"));

        assertThat(exits).isEmpty();
    }
}
