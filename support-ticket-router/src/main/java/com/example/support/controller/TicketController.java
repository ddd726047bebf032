package com.example.support.controller;

import com.example.support.dto.TicketResponse;
import com.example.support.service.TicketRepository;
import com.example.support.service.TicketRouter;
import com.example.support.service.exception.TicketNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@Tag(name = "tickets")
@RestController
@RequestMapping("/api/tickets")
@RequiredArgsConstructor
public class TicketController {

    private final TicketRepository ticketRepository;
    private final TicketRouter ticketRouter;

    @GetMapping("/{ticketId}")
    @Operation(summary = "Get a ticket by id")
    public TicketResponse getTicket(@PathVariable long ticketId) {
        return ticketRepository.findById(ticketId)
                .map(TicketResponse::from)
                .orElseThrow(() -> new TicketNotFoundException(String.valueOf(ticketId)));
    }

    @GetMapping("/by-thread/{threadId}")
    @Operation(summary = "Get the ticket bound to a discussion thread")
    public TicketResponse getByThread(@PathVariable long threadId) {
        return ticketRepository.findByThreadId(threadId)
                .map(TicketResponse::from)
                .orElseThrow(() -> new TicketNotFoundException("thread " + threadId));
    }

    @GetMapping
    @Operation(summary = "Get the open ticket of a conversation")
    public TicketResponse getOpenTicket(@RequestParam @NotBlank String identity) {
        return ticketRepository.findLastOpen(identity)
                .map(TicketResponse::from)
                .orElseThrow(() -> new TicketNotFoundException("open ticket of " + identity));
    }

    @PostMapping("/{ticketId}/close")
    @Operation(summary = "Close a ticket and send the resolution survey to its user")
    public TicketResponse closeTicket(@PathVariable long ticketId) {
        return TicketResponse.from(ticketRouter.closeTicket(ticketId));
    }
}
