// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

/// Shared Jackson configuration for task records and metadata files.
public abstract class Json {

    // Guava module handles collection types like Multimaps, JavaTimeModule the dates and instants
    // in task parameters. Dates are written as ISO strings rather than numeric arrays.
    public static final ObjectMapper objectMapper = new ObjectMapper()
          .registerModule(new GuavaModule())
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .enable(SerializationFeature.INDENT_OUTPUT);

    public static void write (File file, Object object) {
        try {
            objectMapper.writeValue(file, object);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    public static <T> T read (Path path, Class<T> type) {
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

}
