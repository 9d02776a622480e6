package com.example.userservice;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserStore userStore;

    public List<User> getUsers() {
        return userStore.findAll();
    }

    public User createUser(User user) {
        // 클라이언트가 보낸 id 는 무시하고 새로 발급
        user.setId(new ObjectId().toHexString());
        User saved = userStore.insert(user);
        log.info("사용자 생성 - id={}", saved.getId());
        return saved;
    }

    public void deleteUser(String id) {
        ObjectId objectId = ObjectIds.parse(id);
        if (userStore.deleteById(objectId) == 0) {
            throw new UserNotFoundException(id);
        }
        log.info("사용자 삭제 - id={}", id);
    }

    /**
     * PostService 가 게시글 생성/조회 전에 호출하는 존재 확인.
     * 형식이 잘못된 id 는 400, 없는 사용자는 exists=false (200).
     */
    public UserExistsResponse exists(String id) {
        ObjectId objectId = ObjectIds.parse(id);
        boolean exists = userStore.countById(objectId) > 0;
        log.debug("사용자 존재 확인 - id={}, exists={}", id, exists);
        return new UserExistsResponse(id, exists);
    }
}
