package com.phonepe.tierstore.core.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.phonepe.tierstore.core.errors.ErrorType;
import com.phonepe.tierstore.core.errors.StorageError;
import lombok.experimental.UtilityClass;

import java.io.IOException;

/**
 * Shared Jackson setup. Everything written to disk (archive files, index columns, snapshots, config) goes through a
 * mapper built here.
 */
@UtilityClass
public class JsonUtils {

    public static JsonMapper createMapper() {
        final var mapper = new JsonMapper();
        mapper.findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS);
        return mapper;
    }

    public static byte[] write(final ObjectMapper mapper, final Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        }
        catch (IOException e) {
            throw StorageError.ioFailure(e);
        }
    }

    public static String writeString(final ObjectMapper mapper, final Object value) {
        try {
            return mapper.writeValueAsString(value);
        }
        catch (IOException e) {
            throw StorageError.ioFailure(e);
        }
    }

    /**
     * Reads a value, reporting failures as {@link ErrorType#CORRUPT}
     *
     * @param mapper Mapper to use
     * @param data   Serialized bytes
     * @param type   Target type
     * @param what   Description of the data source, used in the error message
     */
    public static <T> T read(final ObjectMapper mapper, final byte[] data, final TypeReference<T> type, String what) {
        try {
            return mapper.readValue(data, type);
        }
        catch (IOException e) {
            throw StorageError.error(ErrorType.CORRUPT, e, what, e.getMessage());
        }
    }

    public static <T> T read(final ObjectMapper mapper, final byte[] data, final Class<T> type, String what) {
        try {
            return mapper.readValue(data, type);
        }
        catch (IOException e) {
            throw StorageError.error(ErrorType.CORRUPT, e, what, e.getMessage());
        }
    }

    public static <T> T read(final ObjectMapper mapper, final String data, final TypeReference<T> type, String what) {
        try {
            return mapper.readValue(data, type);
        }
        catch (IOException e) {
            throw StorageError.error(ErrorType.CORRUPT, e, what, e.getMessage());
        }
    }

    public static <T> T read(final ObjectMapper mapper, final String data, final Class<T> type, String what) {
        try {
            return mapper.readValue(data, type);
        }
        catch (IOException e) {
            throw StorageError.error(ErrorType.CORRUPT, e, what, e.getMessage());
        }
    }
}
