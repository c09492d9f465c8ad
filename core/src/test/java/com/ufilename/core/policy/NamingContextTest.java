package com.ufilename.core.policy;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NamingContextTest {

    @Test
    void withBase_replacesOnlyBase() {
        NamingContext ctx = new NamingContext("a", ".log", Path.of("/tmp/out"), Map.of("k", 1));

        NamingContext next = ctx.withBase("b");

        assertThat(next.base()).isEqualTo("b");
        assertThat(next.ext()).isEqualTo(".log");
        assertThat(next.directory()).isEqualTo(Path.of("/tmp/out"));
        assertThat(next.metadata()).containsEntry("k", 1);
        assertThat(ctx.base()).isEqualTo("a");
    }

    @Test
    void metadata_isCopiedAndUnmodifiable_nullValuesAllowed() {
        Map<String, Object> source = new HashMap<>();
        source.put("present", "v");
        source.put("nothing", null);

        NamingContext ctx = new NamingContext("a", "", null, source);
        source.put("late", 1);

        assertThat(ctx.metadata()).containsOnlyKeys("present", "nothing");
        assertThatThrownBy(() -> ctx.metadata().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullMetadata_becomesEmpty() {
        assertThat(new NamingContext("a", "", null, null).metadata()).isEmpty();
    }
}
