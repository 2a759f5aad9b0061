package com.airlinereservation.booking.controller.v1;

import com.airlinereservation.booking.dto.BookingEntry;
import com.airlinereservation.booking.dto.BookingHistoryResponse;
import com.airlinereservation.booking.dto.BookingRequest;
import com.airlinereservation.booking.dto.SeatBookingRequest;
import com.airlinereservation.booking.service.BookingHistoryService;
import com.airlinereservation.booking.service.BookingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/v1/tickets")
@RequiredArgsConstructor
@Slf4j
public class TicketController {

    private final BookingService bookingService;
    private final BookingHistoryService bookingHistoryService;

    @PostMapping("/book")
    public ResponseEntity<BookingEntry> bookTickets(
            @RequestParam Long customerId,
            @Valid @RequestBody BookingRequest request) {

        log.info("POST /v1/tickets/book - customer={}, legs={}", customerId, request.getFlights().size());

        BookingEntry entry = bookingService.bookTickets(customerId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @PostMapping("/seat")
    public ResponseEntity<Map<String, Object>> bookSeat(
            @RequestParam Long customerId,
            @Valid @RequestBody SeatBookingRequest request) {

        log.info("POST /v1/tickets/seat - customer={}, flight={}, date={}, seat={}",
                customerId, request.getFlightNumber(), request.getFlightDate(), request.getSeatNumber());

        boolean booked = bookingService.bookSeat(customerId, request);
        return ResponseEntity.ok(Map.of(
                "seatBooked", booked,
                "seatNumber", request.getSeatNumber()));
    }

    @GetMapping("/history")
    public ResponseEntity<BookingHistoryResponse> history(@RequestParam Long customerId) {
        log.debug("GET /v1/tickets/history - customer={}", customerId);
        return ResponseEntity.ok(bookingHistoryService.getHistory(customerId));
    }

    @DeleteMapping("/{ticketId}")
    public ResponseEntity<Void> cancel(@PathVariable Long ticketId, @RequestParam Long customerId) {
        log.info("DELETE /v1/tickets/{} - customer={}", ticketId, customerId);
        bookingService.cancelTicket(customerId, ticketId);
        return ResponseEntity.noContent().build();
    }
}
