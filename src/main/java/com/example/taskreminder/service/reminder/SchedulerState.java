package com.example.taskreminder.service.reminder;

public enum SchedulerState {
    STOPPED,
    RUNNING
}
