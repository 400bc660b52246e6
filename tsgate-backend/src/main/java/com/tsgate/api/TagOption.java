package com.tsgate.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tsgate.model.PayloadType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One tag key and its distinct values, rendered as a panel payload widget.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TagOption {
    @JsonIgnore
    private String key;

    @Builder.Default
    private PayloadType type = PayloadType.SELECT;

    @JsonProperty("placeholder")
    private String placeHolder;

    @Builder.Default
    @JsonProperty("options")
    private List<LabelValue> valueOptions = new ArrayList<>();

    @JsonProperty("label")
    public String getLabel() {
        return key;
    }

    @JsonProperty("name")
    public String getName() {
        return key;
    }
}
