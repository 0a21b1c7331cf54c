package org.jrename;

import com.google.gson.Gson;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.util.Map;
import org.eclipse.lsp4j.jsonrpc.json.MessageJsonHandler;
import org.jrename.semantics.SymbolKey;

public class JsonHelper {
    /** lsp4j's Gson setup, so {@code Either} values in a {@code WorkspaceEdit} are written as plain objects. */
    public static final Gson GSON =
            new MessageJsonHandler(Map.of())
                    .getDefaultGsonBuilder()
                    .registerTypeAdapter(SymbolKey.class, new SymbolKeyAdapter())
                    .setPrettyPrinting()
                    .create();

    /** Keys are written as their path string, {@code "lib/Shape#area()"}. */
    static class SymbolKeyAdapter extends TypeAdapter<SymbolKey> {
        @Override
        public void write(JsonWriter out, SymbolKey key) throws IOException {
            if (key == null) {
                out.nullValue();
                return;
            }
            out.value(key.toString());
        }

        @Override
        public SymbolKey read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return new SymbolKey(in.nextString());
        }
    }
}
