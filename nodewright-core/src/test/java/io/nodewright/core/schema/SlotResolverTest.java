package io.nodewright.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.nodewright.core.TestWorkflows;
import io.nodewright.core.exception.SlotException;
import io.nodewright.core.graph.InputSlot;
import io.nodewright.core.graph.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("SlotResolver")
class SlotResolverTest {

    private SlotResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new SlotResolver(InMemoryNodeSchemaRegistry.withDefaults());
    }

    @ParameterizedTest(name = "input ''{0}'' resolves to {1}")
    @CsvSource({"0, 0", "3, 3", "model, 0", "LATENT_IMAGE, 3", "conditioning, 1", "latent, 3"})
    void shouldResolveInputByIndexNameOrType(String spec, int expected) throws Exception {
        assertThat(resolver.resolveInput(TestWorkflows.sampler(1), spec)).isEqualTo(expected);
    }

    @Test
    @DisplayName("resolves output by type tag")
    void shouldResolveOutputByType() throws Exception {
        assertThat(resolver.resolveOutput(TestWorkflows.loader(1), "vae")).isEqualTo(2);
    }

    @Test
    @DisplayName("falls back to schema-declared names")
    void shouldUseSchemaNames() throws Exception {
        Node renamed =
                TestWorkflows.node(1, "VAEDecode")
                        .input(InputSlot.unconnected("in0", "LATENT"))
                        .input(InputSlot.unconnected("in1", "VAE"))
                        .build();

        assertThat(resolver.resolveInput(renamed, "vae")).isEqualTo(1);
    }

    @Test
    @DisplayName("lists available slots when nothing matches")
    void shouldListAvailableSlots() {
        assertThatThrownBy(() -> resolver.resolveInput(TestWorkflows.decoder(3), "clip"))
                .isInstanceOf(SlotException.class)
                .hasMessageContaining("0:samples, 1:vae");
    }

    @Test
    @DisplayName("rejects an index out of range")
    void shouldRejectIndexOutOfRange() {
        assertThatThrownBy(() -> resolver.resolveOutput(TestWorkflows.decoder(3), "4"))
                .isInstanceOf(SlotException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    @DisplayName("rejects an index too large for an int")
    void shouldRejectOverflowingIndex() {
        assertThatThrownBy(() -> resolver.resolveInput(TestWorkflows.sampler(1), "99999999999"))
                .isInstanceOf(SlotException.class)
                .hasMessageContaining("99999999999")
                .hasMessageContaining("out of range");
    }
}
