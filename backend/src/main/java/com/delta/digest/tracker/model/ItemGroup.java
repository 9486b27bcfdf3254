package com.delta.digest.tracker.model;

import java.util.List;

public record ItemGroup(String groupKey, List<Item> items) {}
