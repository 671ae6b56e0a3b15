package com.cosave.backend.auth.token.store;

public class RecordNotFoundException extends RefreshStoreException {

    public RecordNotFoundException(String recordId, String reason) {
        super("refresh record not active: " + recordId + " (" + reason + ")");
    }
}
