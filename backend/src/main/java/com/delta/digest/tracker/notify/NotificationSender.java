package com.delta.digest.tracker.notify;

import com.delta.digest.tracker.model.ItemGroup;
import com.delta.digest.tracker.model.NotificationResult;

import java.util.List;

public interface NotificationSender {
    NotificationResult send(List<ItemGroup> groups);
}
