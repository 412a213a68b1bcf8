package com.autonomous.socialcrew.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskError {
    private ErrorKind kind;
    private String message;
}
