package feed.reader.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "users")
@Getter
@Setter
@ToString(exclude = "feeds")
@EqualsAndHashCode(exclude = "feeds")
public class User {
    @Id
    private String id; // OAuth subject

    private String primaryEmail;

    @OneToMany(mappedBy = "owner", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<Feed> feeds = new ArrayList<>();
}
