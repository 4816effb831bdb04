package com.example.bookreview.service;

import com.example.bookreview.api.dto.BookDetailRes;
import com.example.bookreview.api.dto.ImageRes;
import com.example.bookreview.api.dto.ReviewRes;
import com.example.bookreview.domain.Book;
import com.example.bookreview.domain.Review;
import com.example.bookreview.domain.Role;
import com.example.bookreview.domain.User;
import com.example.bookreview.exception.NotFoundException;
import com.example.bookreview.repo.BookRepo;
import com.example.bookreview.repo.CommentRepo;
import com.example.bookreview.repo.ImageRepo;
import com.example.bookreview.repo.ReviewRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.example.bookreview.testutil.TestEntities.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReviewAggregationServiceTest {

    @Mock
    private BookRepo bookRepo;
    @Mock
    private ReviewRepo reviewRepo;
    @Mock
    private CommentRepo commentRepo;
    @Mock
    private ImageRepo imageRepo;

    @InjectMocks
    private ReviewAggregationService aggregationService;

    private Book book;

    @BeforeEach
    void setUp() {
        book = book(1L);
    }

    @Test
    @DisplayName("Unknown book is NotFound and no review query runs")
    void unknownBook() {
        when(bookRepo.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> aggregationService.getBookDetail(9L))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("Book not found");
        verifyNoInteractions(reviewRepo, commentRepo, imageRepo);
    }

    @Test
    @DisplayName("No reviews gives an average of 0 rather than NaN")
    void noReviews() {
        when(bookRepo.findById(1L)).thenReturn(Optional.of(book));
        when(reviewRepo.findForBookWithAuthors(1L)).thenReturn(List.of());

        BookDetailRes detail = aggregationService.getBookDetail(1L);

        assertThat(detail.averageRating()).isEqualTo(0.0);
        assertThat(detail.totalReviews()).isZero();
        assertThat(detail.reviews()).isEmpty();
        assertThat(detail.book().id()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Ratings 5, 3 and 4 average to 4.0 and each review carries its images and comment count")
    void aggregatesRatingsImagesAndComments() {
        User a = user(1L, Role.USER);
        User b = user(2L, Role.USER);
        User c = user(3L, Role.USER);
        Review r1 = review(11L, book, a, 5);
        Review r2 = review(12L, book, b, 3);
        Review r3 = review(13L, book, c, 4);
        when(bookRepo.findById(1L)).thenReturn(Optional.of(book));
        when(reviewRepo.findForBookWithAuthors(1L)).thenReturn(List.of(r3, r2, r1));
        when(imageRepo.findByReviewIdOrderByCreatedAtAscIdAsc(anyLong())).thenReturn(List.of());
        when(imageRepo.findByReviewIdOrderByCreatedAtAscIdAsc(11L)).thenReturn(List.of(image(1L, r1), image(2L, r1)));
        when(commentRepo.countByReviewId(anyLong())).thenReturn(0L);
        when(commentRepo.countByReviewId(12L)).thenReturn(3L);

        BookDetailRes detail = aggregationService.getBookDetail(1L);

        assertThat(detail.averageRating()).isEqualTo(4.0);
        assertThat(detail.totalReviews()).isEqualTo(3);
        assertThat(detail.reviews()).extracting(ReviewRes::id).containsExactly(13L, 12L, 11L);

        ReviewRes first = detail.reviews().get(2);
        assertThat(first.images()).extracting(ImageRes::id).containsExactly(1L, 2L);
        assertThat(first.userName()).isEqualTo("User 1");
        assertThat(first.userEmail()).isEqualTo("user1@example.com");
        assertThat(detail.reviews().get(1).commentCount()).isEqualTo(3L);
        assertThat(detail.reviews().get(0).images()).isEmpty();
    }

    @Test
    void averageRating_isPlainMean() {
        User u = user(1L, Role.USER);
        List<Review> ratings = List.of(review(1L, book, u, 5), review(2L, book, u, 4));

        assertThat(ReviewAggregationService.averageRating(ratings)).isEqualTo(4.5);
        assertThat(ReviewAggregationService.averageRating(List.of())).isEqualTo(0.0);
    }
}
