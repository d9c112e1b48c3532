package com.ganesh.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * The metadata record of a stored upload. The payload itself lives in the blob store under the
 * same ID.
 *
 * <p>Items are immutable. The ID is assigned by the store on insertion; whatever a caller puts
 * there is replaced. Everything except {@code id} and {@code expires} is opaque to the store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Item {
    private final String id;
    private final String filename;
    private final String contentType;
    private final Instant created;
    private final Instant expires;
    private final Map<String, String> attributes;

    @JsonCreator
    Item(@JsonProperty("id") String id,
         @JsonProperty("filename") String filename,
         @JsonProperty("contentType") String contentType,
         @JsonProperty("created") Instant created,
         @JsonProperty("expires") Instant expires,
         @JsonProperty("attributes") Map<String, String> attributes) {
        this.id = id;
        this.filename = filename;
        this.contentType = contentType;
        this.created = created;
        this.expires = Objects.requireNonNull(expires, "expires");
        this.attributes = attributes == null ? ImmutableMap.of() : ImmutableMap.copyOf(attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonProperty
    public String getId() { return id; }

    @JsonProperty
    public String getFilename() { return filename; }

    @JsonProperty
    public String getContentType() { return contentType; }

    @JsonProperty
    public Instant getCreated() { return created; }

    @JsonProperty
    public Instant getExpires() { return expires; }

    @JsonProperty
    public Map<String, String> getAttributes() { return attributes; }

    /**
     * @param now The reference time.
     * @return {@code true} if the Item's expiry is at or before {@code now}.
     */
    public boolean isExpired(Instant now) {
        return !expires.isAfter(now);
    }

    /**
     * @param newId The ID to assign.
     * @return A copy of this Item carrying {@code newId}.
     */
    public Item withId(String newId) {
        return new Item(newId, filename, contentType, created, expires, attributes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Item)) return false;
        Item other = (Item) o;
        return Objects.equals(id, other.id)
                && Objects.equals(filename, other.filename)
                && Objects.equals(contentType, other.contentType)
                && Objects.equals(created, other.created)
                && expires.equals(other.expires)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, filename, contentType, created, expires, attributes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("id", id)
                .add("filename", filename)
                .add("contentType", contentType)
                .add("created", created)
                .add("expires", expires)
                .add("attributes", attributes.isEmpty() ? null : attributes)
                .toString();
    }

    /**
     * Builder for new Items. Only {@code expires} is required.
     */
    public static class Builder {
        private String filename;
        private String contentType;
        private Instant created;
        private Instant expires;
        private final ImmutableMap.Builder<String, String> attributes = ImmutableMap.builder();

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder created(Instant created) {
            this.created = created;
            return this;
        }

        public Builder expires(Instant expires) {
            this.expires = expires;
            return this;
        }

        public Builder attribute(String key, String value) {
            this.attributes.put(key, value);
            return this;
        }

        public Item build() {
            return new Item(null, filename, contentType, created, expires, attributes.build());
        }
    }
}
