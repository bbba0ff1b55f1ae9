package com.hoopsbot.model;

public enum IlAction {
    MOVE_TO_IL,
    ACTIVATE_FROM_IL
}
