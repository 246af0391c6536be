package com.joshlong.blog.api.posts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * translates failures into {@link ProblemDetail problem details}: bad input is a 400, a
 * missing post is a 404 and anything wrong with the database is a 500.
 */
@ControllerAdvice
class PostExceptionAdvice {

	private final Logger log = LoggerFactory.getLogger(getClass());

	@ExceptionHandler
	ResponseEntity<ProblemDetail> handlePostNotFound(PostNotFoundException ex) {
		this.log.debug("could not find post #{}", ex.getPostId());
		return problem(HttpStatus.NOT_FOUND, "Post not found", ex.getMessage());
	}

	@ExceptionHandler
	ResponseEntity<ProblemDetail> handlePostIdMismatch(PostIdMismatchException ex) {
		this.log.warn(ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Invalid post", ex.getMessage());
	}

	@ExceptionHandler
	ResponseEntity<ProblemDetail> handleInvalidPost(MethodArgumentNotValidException ex) {
		var detail = ex.getBindingResult()
			.getFieldErrors()
			.stream()
			.map(fe -> fe.getField() + " " + fe.getDefaultMessage())
			.sorted()
			.collect(Collectors.joining(", "));
		this.log.warn("rejected an invalid post: {}", detail);
		return problem(HttpStatus.BAD_REQUEST, "Invalid post", detail);
	}

	@ExceptionHandler
	ResponseEntity<ProblemDetail> handleUnreadablePost(HttpMessageNotReadableException ex) {
		this.log.warn("could not read the request body", ex);
		return problem(HttpStatus.BAD_REQUEST, "Invalid post", "the request body could not be read");
	}

	@ExceptionHandler
	ResponseEntity<ProblemDetail> handleUnparseableArgument(MethodArgumentTypeMismatchException ex) {
		this.log.warn("could not convert [{}] for parameter '{}'", ex.getValue(), ex.getName());
		return problem(HttpStatus.BAD_REQUEST, "Invalid post",
				"'" + ex.getValue() + "' is not a valid value for '" + ex.getName() + "'");
	}

	@ExceptionHandler
	ResponseEntity<ProblemDetail> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
		this.log.warn(ex.getMessage());
		return problem(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported media type",
				"the content type " + ex.getContentType() + " is not supported");
	}

	@ExceptionHandler
	ResponseEntity<ProblemDetail> handleUnsupportedMethod(HttpRequestMethodNotSupportedException ex) {
		this.log.warn(ex.getMessage());
		return problem(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed",
				"the method " + ex.getMethod() + " is not supported here");
	}

	@ExceptionHandler
	ResponseEntity<ProblemDetail> handleStoreFailure(DataAccessException ex) {
		this.log.error("the post store failed", ex);
		return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Store failure", "the post store is unavailable");
	}

	private static ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, String detail) {
		var pd = ProblemDetail.forStatusAndDetail(status, detail);
		pd.setTitle(title);
		return ResponseEntity.status(status).body(pd);
	}

}
