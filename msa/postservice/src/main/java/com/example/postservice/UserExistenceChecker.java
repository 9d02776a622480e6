package com.example.postservice;

/**
 * UserService 에 사용자가 존재하는지 묻는다.
 *
 * <p>{@code false} 는 UserService 가 응답했고 사용자가 없다는 뜻이다.
 * 응답을 받지 못했거나 해석할 수 없으면 {@link UserServiceUnavailableException} 을 던지며,
 * 이 경우를 "없음" 으로 취급하면 안 된다 (502 와 404 는 구분된다).
 */
public interface UserExistenceChecker {

    boolean userExists(String userId);
}
