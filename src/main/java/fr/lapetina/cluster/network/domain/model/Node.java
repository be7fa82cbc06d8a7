package fr.lapetina.cluster.network.domain.model;

import java.net.URI;
import java.util.Objects;

/**
 * Represents a member node of the cluster.
 *
 * Immutable. A membership change replaces the node wholesale, it is never
 * mutated in place. Identity is the integer id: two nodes with the same id
 * are equal regardless of URL or availability.
 */
public final class Node {
    private final int id;
    private final URI url;
    private final boolean available;

    private Node(Builder builder) {
        this.id = builder.id;
        this.url = Objects.requireNonNull(builder.url, "Node URL is required");
        this.available = builder.available;
    }

    public int getId() {
        return id;
    }

    public URI getUrl() {
        return url;
    }

    /**
     * Whether the node is eligible to receive balanced traffic.
     */
    public boolean isAvailable() {
        return available;
    }

    /**
     * Returns a copy of this node with the given availability.
     */
    public Node withAvailable(boolean available) {
        if (this.available == available) {
            return this;
        }
        return builder().id(id).url(url).available(available).build();
    }

    /**
     * Creates an available node.
     */
    public static Node of(int id, String url) {
        return builder().id(id).url(url).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node that = (Node) o;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "Node{" +
                "id=" + id +
                ", url=" + url +
                ", available=" + available +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int id;
        private URI url;
        private boolean available = true;

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder url(String url) {
            this.url = URI.create(url);
            return this;
        }

        public Builder url(URI url) {
            this.url = url;
            return this;
        }

        public Builder available(boolean available) {
            this.available = available;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}
