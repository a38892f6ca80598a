package io.workflow.spi;

/**
 * Converts log payloads to and from text for stores that persist outside the JVM.
 *
 * <p>The engine does not prescribe a wire format. Hosts plug in their own serializer
 * (JSON, XML, ...) that knows how to round-trip their event and command types.
 */
public interface PayloadCodec {

    /**
     * Codec that only accepts {@link String} payloads and stores them verbatim.
     */
    static PayloadCodec strings() {
        return StringPayloadCodec.INSTANCE;
    }

    String encode(Object payload);

    Object decode(String text);

    /**
     * Pass-through codec returned by {@link #strings()}.
     */
    final class StringPayloadCodec implements PayloadCodec {
        static final StringPayloadCodec INSTANCE = new StringPayloadCodec();

        private StringPayloadCodec() {
        }

        @Override
        public String encode(Object payload) {
            if (payload instanceof String s) {
                return s;
            }
            throw new IllegalArgumentException("String payload codec cannot encode "
                    + (payload == null ? "null" : payload.getClass().getName()));
        }

        @Override
        public Object decode(String text) {
            return text;
        }
    }
}
