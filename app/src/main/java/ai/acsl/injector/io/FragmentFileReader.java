package ai.acsl.injector.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes a fragment file into plain lists and strings. The shape is checked later by
 * {@link ai.acsl.injector.inject.FragmentList#from(Object)}.
 */
public class FragmentFileReader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public Object read(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path must be provided");
        }
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read fragment file: " + path, ex);
        }
        return parse(json, path.toString());
    }

    public Object parse(String json, String origin) {
        try {
            return MAPPER.readValue(json, Object.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Fragment file is not valid JSON: " + origin + " ("
                    + ex.getOriginalMessage() + ")", ex);
        }
    }
}
