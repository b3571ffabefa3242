package com.conveyal.wtt.util.json;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
/**
 * Helper methods for writing reconciliation results as JSON.
 */
public class JsonManager<T> {
    private final ObjectWriter ow;
    private final ObjectMapper om;
    private final Class<T> theClass;

    /**
     * Create a new JsonManager
     * @param theClass The class to create a json manager for (yes, also in the diamonds).
     */
    public JsonManager (Class<T> theClass) {
        this.theClass = theClass;
        this.om = new ObjectMapper();
        om.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        this.ow = om.writer();
    }

    public String writePretty(T o) throws JsonProcessingException {
        return ow.withDefaultPrettyPrinter().writeValueAsString(o);
    }

    public T read (String s) throws JsonParseException, JsonMappingException, IOException {
        return om.readValue(s, theClass);
    }
}
