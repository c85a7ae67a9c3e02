/*
 * どこで: Users サービス層
 * 何を: ユーザーの作成と取得を Repository に委譲する
 * なぜ: gRPC の入出力変換と永続化の呼び出しを分離するため
 */
package com.example.mesh.users.service;

import com.example.mesh.users.model.NewUser;
import com.example.mesh.users.model.UserRecord;
import com.example.mesh.users.repository.UserRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserService {

  private static final Logger logger = LoggerFactory.getLogger(UserService.class);

  private final UserRepository userRepository;

  /** Stores exactly one new row; identical requests produce distinct users. */
  public UserRecord createUser(NewUser user) {
    final UserRecord created = userRepository.insert(user);
    logger.info("user created id={}", created.id());
    return created;
  }

  public Optional<UserRecord> findUser(long id) {
    return userRepository.findById(id);
  }
}
