package io.github.varda.expressions.jpa.entities;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "sample_groups")
public class SampleGroup {

    @Id
    private Long id;

    private String name;

    protected SampleGroup() {
    }

    public SampleGroup(Long id, String name) {
        this.id = id;
        this.name = name;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }
}
