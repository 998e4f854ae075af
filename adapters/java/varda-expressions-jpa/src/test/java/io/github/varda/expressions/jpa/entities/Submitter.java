package io.github.varda.expressions.jpa.entities;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "submitters")
public class Submitter {

    @Id
    private Long id;

    private String login;

    protected Submitter() {
    }

    public Submitter(Long id, String login) {
        this.id = id;
        this.login = login;
    }

    public Long getId() {
        return id;
    }

    public String getLogin() {
        return login;
    }
}
