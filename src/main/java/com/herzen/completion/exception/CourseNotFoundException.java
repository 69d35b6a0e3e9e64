package com.herzen.completion.exception;

public class CourseNotFoundException extends RuntimeException {

    public CourseNotFoundException(String courseId) {
        super(String.format("Course %s not found", courseId));
    }

    public CourseNotFoundException(String courseId, Throwable cause) {
        super(String.format("Course %s not found", courseId), cause);
    }
}
