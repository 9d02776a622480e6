package com.example.postservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 게시글 생성부터 작성자 삭제 이후까지의 흐름.
 * 저장소는 Map, UserService 는 등록된 사용자 집합으로 대신한다.
 */
@WebMvcTest(controllers = PostController.class)
@Import(PostService.class)
class PostLifecycleScenarioTest {

    private static final String ALICE_ID = new ObjectId().toHexString();

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private PostStore postStore;

    @MockBean
    private UserExistenceChecker userExistenceChecker;

    private final Map<String, Post> posts = new LinkedHashMap<>();
    private final Set<String> users = new HashSet<>();
    private boolean userServiceDown;

    @BeforeEach
    void setUp() {
        when(postStore.insert(any(Post.class))).thenAnswer(invocation -> {
            Post post = invocation.getArgument(0);
            post.setId(new ObjectId().toHexString());
            posts.put(post.getId(), post);
            return post;
        });
        when(postStore.findByUserId(anyString())).thenAnswer(invocation -> posts.values().stream()
                .filter(post -> post.getUserId().equals(invocation.getArgument(0)))
                .collect(Collectors.toList()));
        when(postStore.deleteById(any(ObjectId.class))).thenAnswer(invocation -> {
            ObjectId id = invocation.getArgument(0);
            return posts.remove(id.toHexString()) == null ? 0L : 1L;
        });
        when(userExistenceChecker.userExists(anyString())).thenAnswer(invocation -> {
            if (userServiceDown) {
                throw new UserServiceUnavailableException(invocation.getArgument(0), "Connection refused");
            }
            return users.contains(invocation.<String>getArgument(0));
        });
    }

    private String postBody(String userId) {
        return "{\"user_id\":\"" + userId + "\",\"title\":\"T\",\"content\":\"C\"}";
    }

    @Test
    @DisplayName("작성자가 삭제되면 사용자별 조회는 남은 게시글 대신 404")
    void listAfterUserDeletion() throws Exception {
        users.add(ALICE_ID);

        String created = mockMvc.perform(post("/posts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(postBody(ALICE_ID)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user_id").value(ALICE_ID))
                .andReturn().getResponse().getContentAsString();
        JsonNode createdPost = objectMapper.readTree(created);

        mockMvc.perform(get("/posts/" + ALICE_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.posts", hasSize(1)))
                .andExpect(jsonPath("$.posts[0].id").value(createdPost.get("id").asText()));

        users.remove(ALICE_ID);

        mockMvc.perform(get("/posts/" + ALICE_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("user does not exist"));

        // 게시글 자체는 남아 있다 (dangling reference)
        assertEquals(1, posts.size());
    }

    @Test
    @DisplayName("UserService 장애 중 생성 요청은 502 이고 저장소는 그대로")
    void createWhileUserServiceDown() throws Exception {
        users.add(ALICE_ID);
        userServiceDown = true;

        mockMvc.perform(post("/posts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(postBody(ALICE_ID)))
                .andExpect(status().isBadGateway());

        userServiceDown = false;

        mockMvc.perform(get("/posts/" + ALICE_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.posts", hasSize(0)));
    }

    @Test
    @DisplayName("없는 사용자로 생성하면 404 이고 저장소는 그대로")
    void createForMissingUser() throws Exception {
        mockMvc.perform(post("/posts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(postBody(ALICE_ID)))
                .andExpect(status().isNotFound());

        users.add(ALICE_ID);

        mockMvc.perform(get("/posts/" + ALICE_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.posts", hasSize(0)));
    }

    @Test
    @DisplayName("삭제는 작성자 삭제와 무관하고, 두 번째 삭제는 404")
    void deleteIsIndependentOfUser() throws Exception {
        users.add(ALICE_ID);
        String created = mockMvc.perform(post("/posts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(postBody(ALICE_ID)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        String postId = objectMapper.readTree(created).get("id").asText();

        users.remove(ALICE_ID);
        userServiceDown = true;

        mockMvc.perform(delete("/posts/" + postId))
                .andExpect(status().isOk());
        mockMvc.perform(delete("/posts/" + postId))
                .andExpect(status().isNotFound());
    }
}
