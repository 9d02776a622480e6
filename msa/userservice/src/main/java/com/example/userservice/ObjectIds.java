package com.example.userservice;

import org.bson.types.ObjectId;

final class ObjectIds {

    static final String INVALID_HEX_MESSAGE = "the provided hex string is not a valid ObjectID";

    private ObjectIds() {
    }

    /**
     * 경로로 들어온 식별자를 ObjectId 로 변환한다. 형식이 틀리면 저장소를 조회하기 전에 {@link InvalidIdException}.
     */
    static ObjectId parse(String hex) {
        if (hex == null || !ObjectId.isValid(hex)) {
            throw new InvalidIdException(hex, INVALID_HEX_MESSAGE);
        }
        return new ObjectId(hex);
    }
}
