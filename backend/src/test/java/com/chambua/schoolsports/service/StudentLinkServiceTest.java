package com.chambua.schoolsports.service;

import com.chambua.schoolsports.dto.StudentLinkSubmission;
import com.chambua.schoolsports.exception.BadRequestException;
import com.chambua.schoolsports.exception.NotFoundException;
import com.chambua.schoolsports.model.StudentLink;
import com.chambua.schoolsports.repository.ManagerRepository;
import com.chambua.schoolsports.repository.StudentLinkRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.*;

class StudentLinkServiceTest {
    private StudentLinkRepository linkRepository;
    private ManagerRepository managerRepository;
    private StudentService studentService;
    private StudentLinkTokenGenerator tokenGenerator;
    private StudentLinkService service;

    @BeforeEach
    void setup() {
        linkRepository = Mockito.mock(StudentLinkRepository.class);
        managerRepository = Mockito.mock(ManagerRepository.class);
        studentService = Mockito.mock(StudentService.class);
        tokenGenerator = Mockito.mock(StudentLinkTokenGenerator.class);
        service = new StudentLinkService(linkRepository, managerRepository, studentService, tokenGenerator);
        given(linkRepository.save(any(StudentLink.class))).willAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void collidingTokenIsRedrawn() {
        given(managerRepository.existsById(7L)).willReturn(true);
        given(tokenGenerator.nextToken()).willReturn("taken", "fresh");
        given(linkRepository.existsByToken("taken")).willReturn(true);
        given(linkRepository.existsByToken("fresh")).willReturn(false);

        StudentLink link = service.issue(7L);

        assertEquals("fresh", link.getToken());
        assertEquals(7L, link.getManagerId());
        assertTrue(link.isActive());
        verify(tokenGenerator, times(2)).nextToken();
    }

    @Test
    void issueRequiresExistingManager() {
        assertEquals("Manager ID is required",
                assertThrows(BadRequestException.class, () -> service.issue(null)).getMessage());
        given(managerRepository.existsById(9L)).willReturn(false);
        assertThrows(NotFoundException.class, () -> service.issue(9L));
        verify(linkRepository, never()).save(any());
    }

    @Test
    void inactiveLinkRejectsSubmission() {
        StudentLink link = new StudentLink(3L, "abc");
        link.setActive(false);
        given(linkRepository.findByToken("abc")).willReturn(Optional.of(link));

        StudentLinkSubmission sub = new StudentLinkSubmission();
        sub.setToken("abc");
        sub.setName("Asha");
        sub.setPrnUid("PRN1");
        sub.setContact("9000000000");
        sub.setBirthDate("2004-01-01");

        NotFoundException ex = assertThrows(NotFoundException.class, () -> service.submit(sub));
        assertEquals("Invalid or inactive link", ex.getMessage());
        verifyNoInteractions(studentService);
    }

    @Test
    void tokenGeneratorProducesHex() {
        String token = new StudentLinkTokenGenerator().nextToken();
        assertEquals(64, token.length());
        assertTrue(token.matches("[0-9a-f]+"));
    }
}
