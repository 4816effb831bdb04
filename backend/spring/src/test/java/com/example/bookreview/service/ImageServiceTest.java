package com.example.bookreview.service;

import com.example.bookreview.api.dto.ImageReq;
import com.example.bookreview.domain.*;
import com.example.bookreview.exception.ForbiddenException;
import com.example.bookreview.exception.NotFoundException;
import com.example.bookreview.repo.ImageRepo;
import com.example.bookreview.repo.ReviewRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
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
class ImageServiceTest {

    @Mock
    private ImageRepo imageRepo;
    @Mock
    private ReviewRepo reviewRepo;
    @Spy
    private OwnershipPolicy ownershipPolicy = new OwnershipPolicy();

    @InjectMocks
    private ImageService imageService;

    private User reviewer;
    private User stranger;
    private Review review;

    @BeforeEach
    void setUp() {
        reviewer = user(1L, Role.USER);
        stranger = user(2L, Role.USER);
        review = review(10L, book(5L), reviewer, 5);
    }

    @Test
    void addImage_toOwnReview_saves() {
        when(reviewRepo.findById(10L)).thenReturn(Optional.of(review));
        when(imageRepo.save(any(Image.class))).thenAnswer(invocation -> {
            Image i = invocation.getArgument(0);
            i.setId(70L);
            return i;
        });

        Long id = imageService.addImage(10L, principal(reviewer), new ImageReq(" https://img/x.png ", "cover"));

        assertThat(id).isEqualTo(70L);
        ArgumentCaptor<Image> captor = ArgumentCaptor.forClass(Image.class);
        verify(imageRepo).save(captor.capture());
        assertThat(captor.getValue().getImageUrl()).isEqualTo("https://img/x.png");
        assertThat(captor.getValue().getReview()).isSameAs(review);
    }

    @Test
    void addImage_toSomeoneElsesReview_isForbidden() {
        when(reviewRepo.findById(10L)).thenReturn(Optional.of(review));

        assertThatThrownBy(() -> imageService.addImage(10L, principal(stranger), new ImageReq("https://img/x.png", null)))
            .isInstanceOf(ForbiddenException.class)
            .hasMessage("You can only add images to your own reviews");
        verify(imageRepo, never()).save(any());
    }

    @Test
    void addImage_unknownReview_isNotFound() {
        when(reviewRepo.findById(10L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> imageService.addImage(10L, principal(reviewer), new ImageReq("https://img/x.png", null)))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void deleteImage_ownershipComesFromParentReview() {
        Image image = image(4L, review);
        when(imageRepo.findById(4L)).thenReturn(Optional.of(image));

        assertThatThrownBy(() -> imageService.deleteImage(4L, principal(stranger)))
            .isInstanceOf(ForbiddenException.class)
            .hasMessage("You can only delete images from your own reviews");
        verify(imageRepo, never()).delete(any());

        imageService.deleteImage(4L, principal(reviewer));
        verify(imageRepo).delete(image);
    }

    @Test
    void deleteImage_byAdmin_deletes() {
        Image image = image(4L, review);
        when(imageRepo.findById(4L)).thenReturn(Optional.of(image));

        imageService.deleteImage(4L, principal(user(9L, Role.ADMIN)));

        verify(imageRepo).delete(image);
    }

    @Test
    void deleteImage_missing_isNotFound() {
        when(imageRepo.findById(4L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> imageService.deleteImage(4L, principal(reviewer)))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("Image not found");
    }
}
