package com.example.postservice;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class PostService {

    private final PostStore postStore;
    private final UserExistenceChecker userExistenceChecker;

    /**
     * 작성자가 UserService 에 존재할 때만 저장한다. 확인 이후 사용자가 삭제되는 경우는 보정하지 않는다.
     */
    public Post createPost(Post post) {
        verifyUser(post.getUserId());
        post.setId(null);
        Post saved = postStore.insert(post);
        log.info("게시글 생성 - id={}, userId={}", saved.getId(), saved.getUserId());
        return saved;
    }

    public UserPostsResponse getPostsByUser(String userId) {
        verifyUser(userId);
        return new UserPostsResponse(userId, postStore.findByUserId(userId));
    }

    // 삭제는 사용자 존재 여부와 무관
    public void deletePost(String postId) {
        ObjectId objectId = ObjectIds.parse(postId);
        if (postStore.deleteById(objectId) == 0) {
            throw new PostNotFoundException(postId);
        }
        log.info("게시글 삭제 - id={}", postId);
    }

    private void verifyUser(String userId) {
        if (!userExistenceChecker.userExists(userId)) {
            throw new UserNotFoundException(userId);
        }
    }
}
