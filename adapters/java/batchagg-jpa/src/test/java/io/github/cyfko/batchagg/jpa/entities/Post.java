package io.github.cyfko.batchagg.jpa.entities;

import io.github.cyfko.batchagg.jpa.annotations.Through;
import jakarta.persistence.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "test_post")
public class Post {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String title;

    private Integer score;

    private String status;

    @ManyToOne
    @JoinColumn(name = "author_id")
    private User author;

    @ManyToMany
    @JoinTable(name = "test_post_tag",
            joinColumns = @JoinColumn(name = "post_id"),
            inverseJoinColumns = @JoinColumn(name = "tag_id"))
    private List<Tag> tags = new ArrayList<>();

    @OneToMany(mappedBy = "post")
    private List<PostCategory> postCategories = new ArrayList<>();

    @Transient
    @Through(via = "postCategories")
    private List<Category> categories;

    protected Post() {
    }

    public Post(User author, String title, Integer score, String status) {
        this.author = author;
        this.title = title;
        this.score = score;
        this.status = status;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public Integer getScore() {
        return score;
    }

    public String getStatus() {
        return status;
    }

    public User getAuthor() {
        return author;
    }

    public List<Tag> getTags() {
        return tags;
    }

    @Override
    public String toString() {
        return "Post#" + id + "(" + title + ", " + score + ")";
    }
}
