// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.store;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import io.pfive.chunked.raster.Raster;
import org.objenesis.strategy.SerializingInstantiatorStrategy;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/// Saves and loads rasters and other intermediate results as streams of bytes, typically for
/// storing in files.
public abstract class Serialization {

    /// Kryo instance is not threadsafe, create one instance of this class per thread or call.
    private static Kryo kryoWithDefaults () {
        Kryo kryo = new Kryo();
        kryo.setReferences(false);
        kryo.setRegistrationRequired(false);
        kryo.register(Raster.class, new RasterSerializer());
        // When deserializing objects, try to use a zero-arg constructor if one exists.
        // Then fall back on some less efficient reflection approaches which require the class to be serializable.
        kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new SerializingInstantiatorStrategy()));
        return kryo;
    }

    public static void write (OutputStream outputStream, Object object) {
        Kryo kryo = kryoWithDefaults();
        Output kryoOut = new Output(outputStream);
        kryo.writeClassAndObject(kryoOut, object);
        kryoOut.flush();
    }

    public static void write (File file, Object object) {
        try (OutputStream out = new FileOutputStream(file)) {
            write(out, object);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    public static Object read (InputStream inputStream) {
        Kryo kryo = kryoWithDefaults();
        Input kryoIn = new Input(inputStream);
        return kryo.readClassAndObject(kryoIn);
    }

    public static Object read (File file) {
        try (InputStream in = new FileInputStream(file)) {
            return read(in);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    public static <T> T read (File file, Class<T> klass) {
        return klass.cast(read(file));
    }

}
