package com.social.feed.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Entity
@Table(name = "USERS")
@Getter
@ToString
@NoArgsConstructor
public class User {

    // 식별자는 클라이언트가 지정 (자동 생성 X)
    @Id
    @Column(name = "USER_ID")
    private Long id;

    @Column(name = "NAME", nullable = false)
    private String name;

    public static User of(Long id, String name) {
        User u = new User();
        u.id = id;
        u.name = name;
        return u;
    }
}
