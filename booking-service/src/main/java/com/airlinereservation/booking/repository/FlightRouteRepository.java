package com.airlinereservation.booking.repository;

import com.airlinereservation.booking.model.FlightRoute;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FlightRouteRepository extends JpaRepository<FlightRoute, Integer> {
}
