package vn.com.fecredit.videoupload.model;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface VideoRepository extends JpaRepository<Video, Long> {

    Optional<Video> findBySessionToken(String sessionToken);

    Optional<Video> findByVideoId(String videoId);
}
