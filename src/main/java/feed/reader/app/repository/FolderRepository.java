package feed.reader.app.repository;

import feed.reader.app.entity.Folder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface FolderRepository extends JpaRepository<Folder, String> {
    List<Folder> findByOwnerIdOrderByNameAsc(String ownerId);
    Optional<Folder> findByIdAndOwnerId(String id, String ownerId);
    List<Folder> findByOwnerIdAndIdIn(String ownerId, Collection<String> ids);
    long countByOwnerId(String ownerId);
}
