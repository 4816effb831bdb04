package com.example.bookreview.service;

import com.example.bookreview.api.dto.ReviewReq;
import com.example.bookreview.domain.Book;
import com.example.bookreview.domain.Review;
import com.example.bookreview.domain.Role;
import com.example.bookreview.domain.User;
import com.example.bookreview.exception.DuplicateReviewException;
import com.example.bookreview.exception.ForbiddenException;
import com.example.bookreview.exception.NotFoundException;
import com.example.bookreview.exception.ValidationException;
import com.example.bookreview.repo.BookRepo;
import com.example.bookreview.repo.ReviewRepo;
import com.example.bookreview.repo.UserRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static com.example.bookreview.testutil.TestEntities.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewServiceTest {

    @Mock
    private ReviewRepo reviewRepo;
    @Mock
    private BookRepo bookRepo;
    @Mock
    private UserRepo userRepo;
    @Spy
    private OwnershipPolicy ownershipPolicy = new OwnershipPolicy();

    @InjectMocks
    private ReviewService reviewService;

    private User author;
    private User stranger;
    private User admin;
    private Book book;

    @BeforeEach
    void setUp() {
        author = user(1L, Role.USER);
        stranger = user(2L, Role.USER);
        admin = user(3L, Role.ADMIN);
        book = book(100L);
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 0, 6, 10})
    void createReview_ratingOutOfRange_failsWithoutInsert(int rating) {
        assertThatThrownBy(() -> reviewService.createReview(100L, principal(author), new ReviewReq(rating, "text")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Rating must be between 1 and 5");

        verify(reviewRepo, never()).save(any());
        verifyNoInteractions(bookRepo);
    }

    @ParameterizedTest
    @ValueSource(doubles = {4.5, 1.01, 0.5})
    void createReview_fractionalRating_failsWithoutInsert(double rating) {
        assertThatThrownBy(() -> reviewService.createReview(100L, principal(author), new ReviewReq(rating, "text")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Rating must be between 1 and 5");

        verify(reviewRepo, never()).save(any());
    }

    @Test
    void requireRating_acceptsWholeNumberWrittenAsDecimal() {
        assertThat(ReviewService.requireRating(3.0)).isEqualTo(3);
    }

    @Test
    void createReview_missingRating_fails() {
        assertThatThrownBy(() -> reviewService.createReview(100L, principal(author), new ReviewReq(null, "text")))
            .isInstanceOf(ValidationException.class);
        verify(reviewRepo, never()).save(any());
    }

    @Test
    void createReview_unknownBook_isNotFound() {
        when(bookRepo.findById(100L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reviewService.createReview(100L, principal(author), new ReviewReq(4, null)))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("Book not found");
        verify(reviewRepo, never()).save(any());
    }

    @Test
    void createReview_secondReviewOnSameBook_isDuplicate() {
        when(bookRepo.findById(100L)).thenReturn(Optional.of(book));
        when(reviewRepo.existsByBookIdAndUserId(100L, 1L)).thenReturn(true);

        assertThatThrownBy(() -> reviewService.createReview(100L, principal(author), new ReviewReq(5, "again")))
            .isInstanceOf(DuplicateReviewException.class)
            .hasMessage("You have already reviewed this book");
        verify(reviewRepo, never()).save(any());
    }

    @Test
    void createReview_insertsAndReturnsId() {
        when(bookRepo.findById(100L)).thenReturn(Optional.of(book));
        when(reviewRepo.existsByBookIdAndUserId(100L, 1L)).thenReturn(false);
        when(userRepo.getReferenceById(1L)).thenReturn(author);
        when(reviewRepo.save(any(Review.class))).thenAnswer(invocation -> {
            Review r = invocation.getArgument(0);
            r.setId(55L);
            return r;
        });

        Long id = reviewService.createReview(100L, principal(author), new ReviewReq(4, "Solid read"));

        assertThat(id).isEqualTo(55L);
        ArgumentCaptor<Review> captor = ArgumentCaptor.forClass(Review.class);
        verify(reviewRepo).save(captor.capture());
        assertThat(captor.getValue().getRating()).isEqualTo(4);
        assertThat(captor.getValue().getBook()).isSameAs(book);
        assertThat(captor.getValue().getUser()).isSameAs(author);
    }

    @Test
    void updateReview_byStranger_isForbiddenAndLeavesReviewUntouched() {
        Review existing = review(7L, book, author, 3);
        when(reviewRepo.findById(7L)).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> reviewService.updateReview(7L, principal(stranger), new ReviewReq(1, "hijack")))
            .isInstanceOf(ForbiddenException.class)
            .hasMessage("You can only edit your own reviews");

        assertThat(existing.getRating()).isEqualTo(3);
        assertThat(existing.getReviewText()).isEqualTo("Review 7");
        verify(reviewRepo, never()).save(any());
    }

    @Test
    void updateReview_byAdmin_isAllowed() {
        Review existing = review(7L, book, author, 3);
        when(reviewRepo.findById(7L)).thenReturn(Optional.of(existing));

        reviewService.updateReview(7L, principal(admin), new ReviewReq(2, "moderated"));

        assertThat(existing.getRating()).isEqualTo(2);
        assertThat(existing.getReviewText()).isEqualTo("moderated");
        verify(reviewRepo).save(existing);
    }

    @Test
    void updateReview_invalidRatingIsCheckedBeforeLookup() {
        assertThatThrownBy(() -> reviewService.updateReview(7L, principal(author), new ReviewReq(9, null)))
            .isInstanceOf(ValidationException.class);
        verifyNoInteractions(reviewRepo);
    }

    @Test
    void deleteReview_byStranger_isForbidden() {
        Review existing = review(7L, book, author, 3);
        when(reviewRepo.findById(7L)).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> reviewService.deleteReview(7L, principal(stranger)))
            .isInstanceOf(ForbiddenException.class)
            .hasMessage("You can only delete your own reviews");
        verify(reviewRepo, never()).delete(any());
    }

    @Test
    void deleteReview_byOwner_deletes() {
        Review existing = review(7L, book, author, 3);
        when(reviewRepo.findById(7L)).thenReturn(Optional.of(existing));

        reviewService.deleteReview(7L, principal(author));

        verify(reviewRepo).delete(existing);
    }

    @Test
    void deleteReview_missing_isNotFound() {
        when(reviewRepo.findById(8L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reviewService.deleteReview(8L, principal(admin)))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("Review not found");
    }

    @Test
    void countReviews_delegatesToStore() {
        when(reviewRepo.count()).thenReturn(12L);

        assertThat(reviewService.countReviews()).isEqualTo(12L);
    }
}
