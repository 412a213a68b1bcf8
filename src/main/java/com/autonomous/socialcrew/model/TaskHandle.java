package com.autonomous.socialcrew.model;

import lombok.Value;

import java.util.List;

@Value
public class TaskHandle {
    List<String> rootTaskIds;
    List<String> taskIds;
}
