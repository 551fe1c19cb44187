package io.b2mash.invoiceintake.watch;

import org.springframework.data.jpa.repository.JpaRepository;

public interface WatchStateRepository extends JpaRepository<WatchState, String> {}
