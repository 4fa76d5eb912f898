package dk.trustworks.filebridge.graph.dto;

import java.util.List;

/**
 * One page of a Graph collection response: the values plus the continuation link, if any.
 */
public interface GraphPage<T> {

    List<T> value();

    String odataNextLink();

    default List<T> items() {
        return value() == null ? List.of() : value();
    }

    default boolean hasNext() {
        return odataNextLink() != null && !odataNextLink().isBlank();
    }
}
