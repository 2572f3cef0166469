package com.odin.share_relay_service.constants;

public class ApplicationConstants {

	public static final String API_VERSION = "/v1";
	public static final String SHARES = "/shares";
	public static final String LINK = "/link";
	public static final String WEBSOCKET_PATH = "/ws";
	public static final String MEMBERSHIP_STATUS = "/v1/membership/status";

	public static final String AUTHORIZATION_HEADER = "Authorization";
	public static final String BEARER_PREFIX = "Bearer ";
	public static final String PRINCIPAL_ATTRIBUTE = "principalId";
	public static final String TOKEN_QUERY_PARAM = "token";

	// Inbound frame types
	public static final String FRAME_COMMAND = "command";
	public static final String FRAME_ITEM = "item";
	public static final String FRAME_CALLBACK = "callback";
	public static final String FRAME_TEXT = "text";
	public static final String FRAME_PING = "ping";

	// Command names
	public static final String COMMAND_START = "start";
	public static final String COMMAND_HELP = "help";
	public static final String COMMAND_BEGIN_UPLOAD = "begin-upload";
	public static final String COMMAND_FINISH_UPLOAD = "finish-upload";
	public static final String COMMAND_CANCEL = "cancel";
	public static final String COMMAND_LIST_MY_SHARES = "list-my-shares";

	// Callback actions
	public static final String ACTION_SHARE_PAGE = "spage";
	public static final String ACTION_LIST_PAGE = "page";
	public static final String ACTION_DELETE = "delete";
	public static final String ACTION_INFO = "info";
	public static final String ACTION_NOOP = "noop";
	public static final String ACTION_COMMAND = "cmd";
	public static final String CALLBACK_SEPARATOR = ":";

	// Outbound frame types
	public static final String OUT_NOTICE = "notice";
	public static final String OUT_ITEM = "item";
	public static final String OUT_PANEL = "panel";
	public static final String OUT_REPLACE = "replace";
	public static final String OUT_RETRACT = "retract";
	public static final String OUT_PONG = "pong";

	// Kafka
	public static final String KAFKA_SHARE_AUDIT_TOPIC = "share.audit.events";

	// Redis
	public static final String REDIS_PENDING_TOKEN_SEGMENT = "pending";

	// Share record defaults
	public static final String BATCH_CAPTION_FORMAT = "Batch upload (%d files)";
	public static final String DEFAULT_CAPTION = "Untitled";

	// Membership statuses that fail the gate
	public static final String MEMBER_STATUS_LEFT = "LEFT";
	public static final String MEMBER_STATUS_BANNED = "BANNED";
	public static final String MEMBER_STATUS_KICKED = "KICKED";

	// Button captions
	public static final String BUTTON_UPLOAD = "📤 Upload files";
	public static final String BUTTON_FINISH = "✅ Finish upload";
	public static final String BUTTON_PREVIOUS = "‹ Previous";
	public static final String BUTTON_NEXT = "Next ›";
	public static final String BUTTON_FIRST = "« First";
	public static final String BUTTON_LAST = "Last »";
	public static final String BUTTON_DELETE = "🗑️ Delete";
	public static final String BUTTON_JOIN_GROUP = "👉 Join the group";
	public static final String BUTTON_RETRY = "✅ I have joined, get the files";

}
