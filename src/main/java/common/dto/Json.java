package common.dto;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/** Shared reader for config files and saves. Unknown properties are ignored so older files still load. */
public final class Json {
    private Json() {}

    public static ObjectMapper mapper() {
        var M = new ObjectMapper();
        M.registerModule(new ParameterNamesModule());
        M.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return M;
    }
}
