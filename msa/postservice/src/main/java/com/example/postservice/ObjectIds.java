package com.example.postservice;

import org.bson.types.ObjectId;

final class ObjectIds {

    static final String INVALID_HEX_MESSAGE = "the provided hex string is not a valid ObjectID";

    private ObjectIds() {
    }

    static ObjectId parse(String hex) {
        if (hex == null || !ObjectId.isValid(hex)) {
            throw new InvalidIdException(hex, INVALID_HEX_MESSAGE);
        }
        return new ObjectId(hex);
    }
}
