package at.sv.lock.store;

import at.sv.lock.schedule.ScheduleConfig;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Reads and writes {@link ScheduleConfig} documents as JSON.
 */
public final class ScheduleConfigMapper {

    private final ObjectMapper mapper;

    public ScheduleConfigMapper() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public ScheduleConfig read(Path file) {
        try {
            return mapper.readValue(file.toFile(), ScheduleConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schedule configuration '" + file + "'", e);
        }
    }

    public ScheduleConfig read(String json) {
        try {
            return mapper.readValue(json, ScheduleConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse schedule configuration", e);
        }
    }

    public String write(ScheduleConfig config) {
        try {
            return mapper.writeValueAsString(config);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize schedule configuration", e);
        }
    }
}
