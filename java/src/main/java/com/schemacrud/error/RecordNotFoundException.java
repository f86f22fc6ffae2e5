package com.schemacrud.error;

public class RecordNotFoundException extends NotFoundException {

    private final Object recordId;

    public RecordNotFoundException(String model, Object recordId) {
        super(model, "Record '" + recordId + "' not found for model: " + model);
        this.recordId = recordId;
    }

    public Object recordId() {
        return recordId;
    }
}
