package com.example.procurement.assistantservice.index;

public enum IndexState {
    EMPTY,
    BUILT
}
