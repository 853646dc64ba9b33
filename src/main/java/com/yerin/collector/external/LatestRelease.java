package com.yerin.collector.external;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LatestRelease(
        @JsonProperty("tag_name") String tagName,
        @JsonProperty("html_url") String htmlUrl
) {}
