/*
 * どこで: Users ドメインモデル
 * 何を: users テーブル相当のドメインレコード
 * なぜ: API/Service/Repository 間でユーザー情報の受け渡しを明確にするため
 */
package com.example.mesh.users.model;

import java.time.Instant;

public record UserRecord(
    long id, String name, String email, Instant createdAt, Instant updatedAt) {}
