package com.papertrail.api.model.stream;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A value published on a search stream. The concrete kind is written as the {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SetAuthorList.class, name = SetAuthorList.TYPE),
    @JsonSubTypes.Type(value = SetPublicationList.class, name = SetPublicationList.TYPE),
    @JsonSubTypes.Type(value = UpdateAuthor.class, name = UpdateAuthor.TYPE),
    @JsonSubTypes.Type(value = UpdatePublication.class, name = UpdatePublication.TYPE)
})
public interface Streamable {
}
