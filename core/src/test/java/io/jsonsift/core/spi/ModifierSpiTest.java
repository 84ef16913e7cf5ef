package io.jsonsift.core.spi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.jsonsift.core.engine.JsonQuery;
import io.jsonsift.core.engine.QueryOptions;
import io.jsonsift.core.modifier.ModifierRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Tests for the {@link Modifier} contract as seen from path evaluation. */
@ExtendWith(MockitoExtension.class)
class ModifierSpiTest {

    @Mock
    private Modifier modifier;

    private JsonQuery query;

    @BeforeEach
    void setUp() {
        var registry = ModifierRegistry.withBuiltins();
        registry.register("tap", modifier);
        query = JsonQuery.create(registry, QueryOptions.DEFAULT);
    }

    @Test
    void receivesCurrentValueAndArgument() {
        when(modifier.apply("[1,2]", "{\"n\":1}")).thenReturn("{\"ok\":true}");

        var value = query.get("{\"a\":[1,2]}", "a|@tap:{\"n\":1}");

        assertThat(value.get("ok").asBoolean()).isTrue();
        verify(modifier).apply("[1,2]", "{\"n\":1}");
    }

    @Test
    void receivesEmptyArgumentWhenNoneGiven() {
        when(modifier.apply(anyString(), anyString())).thenReturn("1");

        assertThat(query.get("[3]", "@tap").asInt()).isEqualTo(1);
        verify(modifier).apply("[3]", "");
    }

    @Test
    void outputFeedsTheRestOfThePath() {
        when(modifier.apply(anyString(), anyString())).thenReturn("{\"inner\":{\"x\":5}}");

        assertThat(query.get("{}", "@tap.inner.x").asInt()).isEqualTo(5);
    }

    @Test
    void emptyOrNullOutputMeansNoResult() {
        when(modifier.apply(anyString(), anyString())).thenReturn("", (String) null);

        assertThat(query.get("{}", "@tap").exists()).isFalse();
        assertThat(query.get("{}", "@tap").exists()).isFalse();
    }

    @Test
    void notInvokedWhenModifiersAreDisabled() {
        var registry = new ModifierRegistry();
        registry.register("tap", modifier);
        var disabled = JsonQuery.create(registry, QueryOptions.builder().disableModifiers(true).build());

        assertThat(disabled.get("{\"@tap\":1}", "@tap").asInt()).isEqualTo(1);
        verify(modifier, never()).apply(anyString(), anyString());
    }

    @Test
    void lambdaImplementation() {
        Modifier upper = (json, arg) -> json.toUpperCase();

        assertThat(upper.apply("\"abc\"", "")).isEqualTo("\"ABC\"");
    }
}
