package nl.bytesoflife.deltacard.decorative;

import nl.bytesoflife.deltacard.renderer.RenderException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory set of decorative definitions, keyed by name. Created by the caller and handed to
 * the renderer; loading definitions from storage is the caller's concern.
 */
public class DecorativeLibrary {

    private final Map<String, DecorativeDefinition> definitions = new LinkedHashMap<>();

    public DecorativeLibrary register(DecorativeDefinition definition) {
        definitions.put(definition.name(), definition);
        return this;
    }

    public Optional<DecorativeDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * @throws RenderException if no definition has this name
     */
    public DecorativeDefinition get(String name) {
        DecorativeDefinition definition = definitions.get(name);
        if (definition == null) {
            throw new RenderException("Decorative element '" + name + "' not found in library. Available: "
                    + String.join(", ", definitions.keySet()));
        }
        return definition;
    }

    public List<String> getNames() {
        return Collections.unmodifiableList(new ArrayList<>(definitions.keySet()));
    }

    public int size() {
        return definitions.size();
    }
}
