package com.stockbook.application.ports;

import com.stockbook.domain.target.Target;
import com.stockbook.domain.target.TargetStatus;

import java.util.List;
import java.util.Optional;

public interface TargetRepository {

    long create(Target target);

    Optional<Target> getById(long id);

    List<Target> list(TargetFilter filter);

    List<Target> listActive();

    boolean update(long id, Target target);

    boolean updateStatus(long id, TargetStatus status);

    boolean delete(long id);
}
