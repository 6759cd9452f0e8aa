package com.example.scenegen_backend.repository;

import com.example.scenegen_backend.model.RateLimitWindow;
import com.example.scenegen_backend.model.RateLimitWindowId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface RateLimitWindowRepository extends JpaRepository<RateLimitWindow, RateLimitWindowId> {

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("""
       update RateLimitWindow w
          set w.requestCount = w.requestCount + 1
        where w.id.bucketKey = :key
          and w.id.windowStart = :windowStart
          and w.requestCount < :max
    """)
    int tryIncrement(@Param("key") String key, @Param("windowStart") long windowStart, @Param("max") int max);

    @Modifying
    @Transactional
    @Query("delete from RateLimitWindow w where w.id.windowStart < :before")
    int deleteWindowsStartedBefore(@Param("before") long before);
}
