package com.example.postservice;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Document("posts")
public class Post {

    @Id
    private String id;

    // UserService 의 사용자 id. 형식 검사는 하지 않고 생성 시점에 존재 여부만 확인한다.
    @NotBlank(message = "user_id must not be blank")
    @JsonProperty("user_id")
    @Field("user_id")
    private String userId;

    private String title;

    private String content;
}
