package com.crisisnavigator.collectors.api;

import com.crisisnavigator.core.model.Activity;
import com.crisisnavigator.core.model.ActivityLevel;

import java.util.List;

public interface ActivityLog {
    Activity record(String type, String message, ActivityLevel level);

    List<Activity> recent(int limit);
}
