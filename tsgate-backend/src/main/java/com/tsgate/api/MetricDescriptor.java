package com.tsgate.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A queryable collection and the tag option lists the panel offers for it.
 *
 * <p>Serialized as {@code {label, value, payload}}, the shape the panel's metric picker reads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class MetricDescriptor {
    @JsonIgnore
    private String name;

    @Builder.Default
    @JsonProperty("payload")
    private List<TagOption> tagOptions = new ArrayList<>();

    @JsonProperty("label")
    public String getLabel() {
        return name;
    }

    @JsonProperty("value")
    public String getValue() {
        return name;
    }
}
