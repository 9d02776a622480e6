package com.example.userservice;

import lombok.RequiredArgsConstructor;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * users 컬렉션 접근. 실패는 Spring 의 DataAccessException 으로 올라간다.
 */
@Repository
@RequiredArgsConstructor
public class UserStore {

    private final MongoTemplate mongoTemplate;

    public List<User> findAll() {
        return mongoTemplate.findAll(User.class);
    }

    public User insert(User user) {
        return mongoTemplate.insert(user);
    }

    public long deleteById(ObjectId id) {
        return mongoTemplate.remove(byId(id), User.class).getDeletedCount();
    }

    // 문서 본문은 가져오지 않는다
    public long countById(ObjectId id) {
        return mongoTemplate.count(byId(id), User.class);
    }

    private static Query byId(ObjectId id) {
        return Query.query(Criteria.where("_id").is(id));
    }
}
