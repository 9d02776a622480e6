package com.example.postservice;

import lombok.RequiredArgsConstructor;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class PostStore {

    private final MongoTemplate mongoTemplate;

    public List<Post> findByUserId(String userId) {
        return mongoTemplate.find(Query.query(Criteria.where("user_id").is(userId)), Post.class);
    }

    public Post insert(Post post) {
        return mongoTemplate.insert(post);
    }

    public long deleteById(ObjectId id) {
        return mongoTemplate.remove(Query.query(Criteria.where("_id").is(id)), Post.class).getDeletedCount();
    }
}
