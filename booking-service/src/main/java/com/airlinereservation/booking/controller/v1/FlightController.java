package com.airlinereservation.booking.controller.v1;

import com.airlinereservation.booking.dto.AvailableSeatsResponse;
import com.airlinereservation.booking.dto.FlightRouteRequest;
import com.airlinereservation.booking.dto.FlightScheduleEntry;
import com.airlinereservation.booking.dto.FlightSearchResponse;
import com.airlinereservation.booking.service.FlightQueryService;
import com.airlinereservation.booking.service.FlightScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/flights")
public class FlightController {

    private final FlightQueryService flightQueryService;
    private final FlightScheduleService flightScheduleService;

    @GetMapping("/search")
    public ResponseEntity<FlightSearchResponse> search(
            @RequestParam String departureCity,
            @RequestParam String destinationCity,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate departureDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("GET /v1/flights/search: {} -> {}, from={}, to={}",
                departureCity, destinationCity, departureDate, endDate);

        return ResponseEntity.ok(flightQueryService.searchFlights(
                departureCity, destinationCity, departureDate, endDate));
    }

    @GetMapping("/available-seats")
    public ResponseEntity<AvailableSeatsResponse> availableSeats(
            @RequestParam Integer flightNumber,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate flightDate) {

        log.debug("GET /v1/flights/available-seats - flight={}, date={}", flightNumber, flightDate);
        return ResponseEntity.ok(flightQueryService.getAvailableSeats(flightNumber, flightDate));
    }

    @PostMapping("/routes")
    public ResponseEntity<FlightScheduleEntry> scheduleRoute(@Valid @RequestBody FlightRouteRequest request) {
        log.info("POST /v1/flights/routes - flight={}, {} -> {}, aircraft={}",
                request.getFlightNumber(), request.getDepartureCity(), request.getDestinationCity(),
                request.getAircraftId());

        FlightScheduleEntry entry = flightScheduleService.scheduleRoute(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }
}
