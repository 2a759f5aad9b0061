package com.airlinereservation.booking.repository;

import com.airlinereservation.booking.enums.SeatStatus;
import com.airlinereservation.booking.model.Seat;
import com.airlinereservation.booking.model.SeatId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SeatRepository extends JpaRepository<Seat, SeatId> {

    Optional<Seat> findByFlightIdAndSeatNumber(Long flightId, Integer seatNumber);

    @Query("SELECT s.seatNumber FROM Seat s WHERE s.flightId = :flightId AND s.status = :status ORDER BY s.seatNumber")
    List<Integer> findSeatNumbersByStatus(@Param("flightId") Long flightId, @Param("status") SeatStatus status);

    /**
     * Moves a seat from AVAILABLE to BOOKED, gated on the version it was read with.
     */
    @Modifying
    @Query("UPDATE Seat s SET s.status = com.airlinereservation.booking.enums.SeatStatus.BOOKED, s.version = s.version + 1 " +
            "WHERE s.flightId = :flightId AND s.seatNumber = :seatNumber AND s.version = :version " +
            "AND s.status = com.airlinereservation.booking.enums.SeatStatus.AVAILABLE")
    int claimSeat(@Param("flightId") Long flightId,
                  @Param("seatNumber") Integer seatNumber,
                  @Param("version") Integer version);

    @Modifying
    @Query("UPDATE Seat s SET s.status = com.airlinereservation.booking.enums.SeatStatus.AVAILABLE, s.version = s.version + 1 " +
            "WHERE s.flightId = :flightId AND s.seatNumber = :seatNumber")
    int releaseSeat(@Param("flightId") Long flightId, @Param("seatNumber") Integer seatNumber);
}
