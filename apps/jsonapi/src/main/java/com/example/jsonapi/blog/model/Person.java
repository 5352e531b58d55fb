package com.example.jsonapi.blog.model;

public record Person(String id, String name, String email) {
}
