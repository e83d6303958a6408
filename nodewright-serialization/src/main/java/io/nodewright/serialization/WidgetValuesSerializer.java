package io.nodewright.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.nodewright.core.graph.WidgetValues;
import java.io.IOException;
import java.io.Serial;

/// Writes widget values in the layout they were loaded with: an array for
/// positional values, an object for keyed values, `null` when absent.
///
/// @implNote Package-private. Registered by {@link NodewrightJacksonModule}.
class WidgetValuesSerializer extends StdSerializer<WidgetValues> {

    @Serial private static final long serialVersionUID = -1967260372286641806L;

    WidgetValuesSerializer() {
        super(WidgetValues.class);
    }

    @Override
    public void serialize(WidgetValues widgets, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        switch (widgets.layout()) {
            case POSITIONAL -> provider.defaultSerializeValue(widgets.asList(), gen);
            case KEYED -> provider.defaultSerializeValue(widgets.asMap(), gen);
            case ABSENT -> gen.writeNull();
        }
    }
}
