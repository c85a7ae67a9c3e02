package com.example.mesh.users.model;

/** A user that has not been stored yet; the id is assigned by the store. */
public record NewUser(String name, String email) {}
