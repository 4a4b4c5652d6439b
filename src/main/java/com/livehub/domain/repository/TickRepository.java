package com.livehub.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;

import com.livehub.domain.entity.TickEntity;

public interface TickRepository extends JpaRepository<TickEntity, Long> {
}
