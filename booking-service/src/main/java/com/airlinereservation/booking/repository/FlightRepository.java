package com.airlinereservation.booking.repository;

import com.airlinereservation.booking.dto.FlightEntry;
import com.airlinereservation.booking.model.Flight;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface FlightRepository extends JpaRepository<Flight, Long> {

    Optional<Flight> findByFlightNumberAndFlightDate(Integer flightNumber, LocalDate flightDate);

    boolean existsByFlightNumber(Integer flightNumber);

    /**
     * Claims one ticket if the row still carries the version it was read with.
     *
     * @return 1 when the claim won, 0 when another writer got there first or the quota is gone
     */
    @Modifying
    @Query("UPDATE Flight f SET f.availableTickets = f.availableTickets - 1, f.version = f.version + 1 " +
            "WHERE f.id = :flightId AND f.version = :version AND f.availableTickets > 0")
    int decrementAvailableTickets(@Param("flightId") Long flightId, @Param("version") Integer version);

    @Modifying
    @Query("UPDATE Flight f SET f.availableTickets = f.availableTickets + 1, f.version = f.version + 1 " +
            "WHERE f.id = :flightId")
    int incrementAvailableTickets(@Param("flightId") Long flightId);

    @Query("SELECT new com.airlinereservation.booking.dto.FlightEntry(" +
            "f.id, f.flightNumber, r.departureCity, r.destinationCity, r.departureTime, r.arrivalTime, " +
            "f.availableTickets, f.flightDate) " +
            "FROM Flight f JOIN FlightRoute r ON f.flightNumber = r.flightNumber " +
            "WHERE r.departureCity = :departureCity AND r.destinationCity = :destinationCity " +
            "AND f.flightDate BETWEEN :startDate AND :endDate " +
            "AND f.availableTickets > 0 " +
            "ORDER BY f.flightDate, r.departureTime")
    List<FlightEntry> searchAvailableFlights(
            @Param("departureCity") String departureCity,
            @Param("destinationCity") String destinationCity,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);
}
