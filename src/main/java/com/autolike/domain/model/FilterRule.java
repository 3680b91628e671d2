package com.autolike.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Filter rule installed on the upstream stream. {@code id} is assigned upstream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FilterRule {

    private String id;
    private String value;
    private String tag;

    public static FilterRule authoredBy(String userId, String tag) {
        return FilterRule.builder()
                .value("from:" + userId)
                .tag(tag)
                .build();
    }
}
