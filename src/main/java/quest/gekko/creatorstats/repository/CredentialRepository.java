package quest.gekko.creatorstats.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.creatorstats.domain.CredentialEntity;

import java.util.Optional;

public interface CredentialRepository extends JpaRepository<CredentialEntity, Long> {
    Optional<CredentialEntity> findByUserIdAndPlatform(final String userId, final String platform);

    @Modifying
    @Query("delete from CredentialEntity c where c.userId = :userId and c.platform = :platform")
    int deleteByUserIdAndPlatform(@Param("userId") final String userId, @Param("platform") final String platform);
}
