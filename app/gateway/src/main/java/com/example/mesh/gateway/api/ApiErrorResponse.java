/*
 * どこで: Gateway API 層
 * 何を: API エラー応答の共通 DTO
 * なぜ: 下流の失敗理由を呼び出し側が機械的に処理できる形で返すため
 */
package com.example.mesh.gateway.api;

public record ApiErrorResponse(String code, String message) {}
