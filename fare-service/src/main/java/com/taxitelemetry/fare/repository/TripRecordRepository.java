package com.taxitelemetry.fare.repository;

import com.taxitelemetry.fare.entity.TripRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TripRecordRepository extends JpaRepository<TripRecordEntity, String> {
}
