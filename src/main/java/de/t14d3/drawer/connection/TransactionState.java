package de.t14d3.drawer.connection;

public enum TransactionState {
    IDLE,
    ACTIVE
}
