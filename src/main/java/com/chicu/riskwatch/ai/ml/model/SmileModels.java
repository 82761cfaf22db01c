package com.chicu.riskwatch.ai.ml.model;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.io.UncheckedIOException;

/**
 * Smile models are {@link Serializable}; their bytes travel inside the JSON bundle (base64).
 */
final class SmileModels {

    private SmileModels() {}

    static byte[] toBytes(Serializable model) {
        if (model == null) return null;
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(buf)) {
            out.writeObject(model);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot serialize " + model.getClass().getSimpleName(), e);
        }
        return buf.toByteArray();
    }

    static <T> T fromBytes(byte[] bytes, Class<T> type) {
        if (bytes == null || bytes.length == 0) return null;
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            return type.cast(in.readObject());
        } catch (IOException | ClassNotFoundException | ClassCastException e) {
            throw new IllegalArgumentException("corrupt " + type.getSimpleName() + " payload", e);
        }
    }
}
