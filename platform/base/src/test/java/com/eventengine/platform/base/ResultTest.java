package com.eventengine.platform.base;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultTest {

    @Test
    void ofCapturesCheckedExceptions() {
        Result<String> result = Result.of(() -> {
            throw new IOException("disk gone");
        });

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).get().isInstanceOf(IOException.class);
    }

    @Test
    void flatMapShortCircuitsOnFailure() {
        Result<Integer> failed = Result.failure("boom");

        Result<Integer> chained = failed.flatMap(n -> Result.success(n + 1));

        assertThat(chained.isFailure()).isTrue();
        assertThat(chained.error()).get().extracting(Throwable::getMessage).isEqualTo("boom");
    }

    @Test
    void foldPicksBranch() {
        String ok = Result.success(2).fold(e -> "failed", n -> "got " + n);
        String ko = Result.<Integer>failure("nope").fold(Throwable::getMessage, n -> "got " + n);

        assertThat(ok).isEqualTo("got 2");
        assertThat(ko).isEqualTo("nope");
    }

    @Test
    void filterOrElseTurnsRejectedValueIntoFailure() {
        Result<Long> result = Result.success(0L)
                .filterOrElse(n -> n > 0, n -> new IllegalStateException("empty"));

        assertThat(result.error()).get().isInstanceOf(IllegalStateException.class);
    }

    @Test
    void getOrThrowRethrowsRuntimeFailureAsIs() {
        Result<String> result = Result.failure(new IllegalArgumentException("bad"));

        assertThatThrownBy(result::getOrThrow)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad");
    }

    @Test
    void onFailureRunsOnlyForFailures() {
        AtomicReference<Throwable> seen = new AtomicReference<>();

        Result.success("x").onFailure(seen::set);
        assertThat(seen.get()).isNull();

        Result.failure("y").onFailure(seen::set);
        assertThat(seen.get()).hasMessage("y");
    }

    @Test
    void sequenceFailsOnFirstFailure() {
        Result<List<Integer>> all = Result.sequence(List.of(Result.success(1), Result.success(2)));
        Result<List<Integer>> broken = Result.sequence(List.of(Result.success(1), Result.<Integer>failure("second")));

        assertThat(all.getOrThrow()).containsExactly(1, 2);
        assertThat(broken.error()).get().extracting(Throwable::getMessage).isEqualTo("second");
    }
}
