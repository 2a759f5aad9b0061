package com.airlinereservation.booking.repository;

import com.airlinereservation.booking.model.Ticket;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TicketRepository extends JpaRepository<Ticket, Long> {

    Optional<Ticket> findByCustomerIdAndFlightId(Long customerId, Long flightId);

    /**
     * Reads a ticket and holds its row lock until the surrounding transaction ends, so a
     * concurrent seat move cannot change the seat between the read and the delete.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Ticket t WHERE t.id = :ticketId")
    Optional<Ticket> findByIdForUpdate(@Param("ticketId") Long ticketId);

    boolean existsByCustomerIdAndFlightId(Long customerId, Long flightId);

    long countByFlightId(Long flightId);

    List<Ticket> findByFlightIdAndSeatNumber(Long flightId, Integer seatNumber);

    @Modifying
    @Query("DELETE FROM Ticket t WHERE t.id = :ticketId")
    int deleteTicketById(@Param("ticketId") Long ticketId);

    @Modifying
    @Query("UPDATE Ticket t SET t.seatNumber = :seatNumber WHERE t.customerId = :customerId AND t.flightId = :flightId")
    int updateSeatNumber(@Param("customerId") Long customerId,
                         @Param("flightId") Long flightId,
                         @Param("seatNumber") Integer seatNumber);

    @Query("SELECT f.flightNumber AS flightNumber, t.seatNumber AS seatNumber, " +
            "r.departureCity AS departureCity, r.destinationCity AS destinationCity, " +
            "f.flightDate AS flightDate, r.departureTime AS departureTime, r.arrivalTime AS arrivalTime " +
            "FROM Ticket t " +
            "JOIN Flight f ON t.flightId = f.id " +
            "JOIN FlightRoute r ON f.flightNumber = r.flightNumber " +
            "WHERE t.customerId = :customerId " +
            "ORDER BY f.flightDate DESC")
    List<BookingHistoryView> findHistoryByCustomerId(@Param("customerId") Long customerId);
}
