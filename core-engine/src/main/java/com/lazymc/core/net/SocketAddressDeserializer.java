package com.lazymc.core.net;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;

/**
 * Jackson deserializer for {@code host:port} strings in configuration files.
 *
 * <p>
 * Unlike the environment path, an address that cannot be parsed or resolved
 * is a mapping error, which fails the whole file.
 * </p>
 */
public class SocketAddressDeserializer extends StdScalarDeserializer<InetSocketAddress> {

    private static final long serialVersionUID = 1L;

    public SocketAddressDeserializer() {
        super(InetSocketAddress.class);
    }

    @Override
    public InetSocketAddress deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            return (InetSocketAddress) ctxt.handleUnexpectedToken(InetSocketAddress.class, p);
        }
        String text = p.getText();
        try {
            return SocketAddressResolver.system().resolve(text);
        } catch (UnknownHostException e) {
            return (InetSocketAddress) ctxt.handleWeirdStringValue(InetSocketAddress.class, text,
                    "failed to resolve host: %s", e.getMessage());
        } catch (IllegalArgumentException e) {
            return (InetSocketAddress) ctxt.handleWeirdStringValue(InetSocketAddress.class, text,
                    "%s", e.getMessage());
        }
    }
}
