package io.github.reugn.cmdargs4j.processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One recognized annotation attached to a {@link Member}.
 *
 * <p>Argument markers keep their values as an ordered parameter list, in the canonical
 * order of the annotation elements:
 * <ul>
 *   <li>{@link Required}: position, name, description, collection</li>
 *   <li>{@link Optional}: default value, name, description, collection</li>
 * </ul>
 * A list shorter than three entries means the annotation could not be read completely.
 * Entries may be {@code null}.
 */
sealed interface Marker {

    /**
     * {@code @RequiredArgument}.
     */
    record Required(List<Object> parameters) implements Marker {
        public Required {
            parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        }
    }

    /**
     * {@code @OptionalArgument}.
     */
    record Optional(List<Object> parameters) implements Marker {
        public Optional {
            parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        }
    }

    /**
     * {@code @CommonArgument}.
     */
    record Common() implements Marker {
    }

    /**
     * {@code @ArgumentGroup}.
     */
    record Group(String name) implements Marker {
    }

    /**
     * {@code @ActionArgument}.
     */
    record Action() implements Marker {
    }
}
