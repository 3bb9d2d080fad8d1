package com.tasktrack.api.todos;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

interface TodoRepository extends JpaRepository<TodoEntity, Long> {

    Optional<TodoEntity> findByIdAndOwnerId(Long id, UUID ownerId);

    List<TodoEntity> findByOwnerIdOrderByIdAsc(UUID ownerId);

    @Query("select t from TodoEntity t"
            + " where t.ownerId = :ownerId"
            + " and (:completed is null or t.completed = :completed)"
            + " and (:pattern is null"
            + "      or lower(t.title) like :pattern escape '\\'"
            + "      or lower(t.description) like :pattern escape '\\')")
    Page<TodoEntity> search(@Param("ownerId") UUID ownerId,
                            @Param("completed") Boolean completed,
                            @Param("pattern") String pattern,
                            Pageable pageable);
}
