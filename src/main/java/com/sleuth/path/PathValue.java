package com.sleuth.path;

import com.sleuth.json.JsonNode;

/** A leaf value together with the canonical path that reaches it. */
public record PathValue(String path, JsonNode value) {}
